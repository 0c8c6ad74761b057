package com.flamingo.ai.xmlrag.service.xml.model;

/**
 * A reference read from a chunk's source element, before resolution.
 *
 * @param relation relation name from the {@link ReferenceHint}
 * @param targetId identifier value the chunk points at
 */
public record DeclaredReference(String relation, String targetId) {}
