package com.nevis.docsearch.messaging;

public final class Topics {

    public static final String DOCUMENT_INDEX = "document.index";
    public static final String DOCUMENT_DELETE = "document.delete";

    private Topics() {
    }
}
