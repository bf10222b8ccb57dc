/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.api;

/** Thrown when an import payload lacks required fields. Nothing is changed when this is raised. */
public class MalformedImportException extends IllegalArgumentException {
    public MalformedImportException(String message) {
        super(message);
    }
}
