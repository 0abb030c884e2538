package com.findly.search.embed;

public enum EmbeddingMode {
    HTTP,
    TOY
}
