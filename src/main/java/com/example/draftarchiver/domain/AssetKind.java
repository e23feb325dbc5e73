package com.example.draftarchiver.domain;

public enum AssetKind {
    AUDIO,
    VIDEO,
    IMAGE
}
