package com.jreinhal.scrubber.model;

public enum ReceiptMode {
    ENCRYPTED,
    NONE
}
