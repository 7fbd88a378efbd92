package com.nevis.docsearch.repository;

import com.nevis.docsearch.model.DeadLetter;

import java.util.List;

public interface DeadLetterRepository {
    DeadLetter save(DeadLetter deadLetter);
    List<DeadLetter> findRecent(int limit);
}
