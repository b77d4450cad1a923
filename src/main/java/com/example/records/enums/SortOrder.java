package com.example.records.enums;

public enum SortOrder {
    ID_ASC,
    ID_DESC,
    NAME,
    TOTAL_DESC
}
