package com.example.routereport.model;

public enum CellType {
    TEXT,
    LINK,
    NUMERIC
}
