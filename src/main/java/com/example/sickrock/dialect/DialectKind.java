package com.example.sickrock.dialect;

public enum DialectKind {
    SQLITE,
    MYSQL
}
