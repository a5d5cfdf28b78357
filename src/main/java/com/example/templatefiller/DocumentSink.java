package com.example.templatefiller;

/** Where filled documents go. */
public interface DocumentSink {

    /**
     * Stores a filled document.
     *
     * @return a URL the document can be fetched from
     * @throws StorageException when the upload fails
     */
    String store(String key, byte[] document);
}
