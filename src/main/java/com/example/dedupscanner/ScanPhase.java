package com.example.dedupscanner;

public enum ScanPhase {
    SCANNING("scanning"),
    HASHING("hashing");

    private final String label;

    ScanPhase(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
