package com.flamingo.ai.memorystore.service.document;

/**
 * A source document name together with the user who uploaded it.
 *
 * @param source the source name
 * @param uploader the uploading user ID
 */
public record SourceListing(String source, String uploader) {}
