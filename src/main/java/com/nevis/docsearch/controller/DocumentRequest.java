package com.nevis.docsearch.controller;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record DocumentRequest(
    @NotBlank
    @Size(max = 500)
    String title,

    @NotBlank
    String content,

    Map<String, Object> metadata
) {}
