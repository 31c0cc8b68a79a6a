package com.example.vrudetect_backend.model;

public enum ResultSource {
    REAL,
    SYNTHETIC
}
