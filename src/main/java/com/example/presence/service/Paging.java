package com.example.presence.service;

import com.example.presence.exception.InvalidInputException;
import com.example.presence.repository.OffsetBasedPageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

final class Paging {

    static final int MAX_LIMIT = 100;

    private Paging() {
    }

    static Pageable of(int limit, long offset, Sort sort) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new InvalidInputException("limit must be between 1 and " + MAX_LIMIT);
        }
        if (offset < 0) {
            throw new InvalidInputException("offset must not be negative");
        }
        return new OffsetBasedPageRequest(offset, limit, sort);
    }
}
