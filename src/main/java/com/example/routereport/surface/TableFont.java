package com.example.routereport.surface;

public enum TableFont {
    REGULAR,
    BOLD,
    ITALIC
}
