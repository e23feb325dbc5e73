package com.example.draftarchiver.exceptions;

import java.io.IOException;

/**
 * Downloaded content does not match the declared length or checksum.
 * Treated like any other I/O failure of a single fetch attempt and retried.
 */
public class AssetIntegrityException extends IOException {

    public AssetIntegrityException(String message) {
        super(message);
    }
}
