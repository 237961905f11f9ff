package com.example.sickrock.model;

import com.example.sickrock.exception.ValidationException;

public record Page(int limit, int offset) {
    public Page {
        if (limit <= 0) {
            throw new ValidationException("limit", "Page limit must be positive");
        }
        if (offset < 0) {
            throw new ValidationException("offset", "Page offset must not be negative");
        }
    }

    public static Page first(int limit) {
        return new Page(limit, 0);
    }

    public Page next() {
        return new Page(limit, offset + limit);
    }
}
