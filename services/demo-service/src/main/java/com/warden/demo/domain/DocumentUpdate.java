package com.warden.demo.domain;

import jakarta.validation.constraints.Size;

/** Partial update of a document; null fields stay unchanged. */
public record DocumentUpdate(@Size(max = 256) String title, String content) {}
