package com.example.routereport.model;

public enum PaginationState {
    IDLE,
    HEADER_PENDING,
    BODY_RENDERING,
    PAGE_BREAK,
    DONE
}
