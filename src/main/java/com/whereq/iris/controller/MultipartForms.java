package com.whereq.iris.controller;

import org.springframework.http.codec.multipart.FilePart;
import org.springframework.http.codec.multipart.FormFieldPart;
import org.springframework.http.codec.multipart.Part;
import org.springframework.util.MultiValueMap;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Helpers for reading multipart forms.
 */
final class MultipartForms {

    static final String FILES = "files";

    private MultipartForms() {
    }

    static List<FilePartImage> files(MultiValueMap<String, Part> parts) {
        return parts.getOrDefault(FILES, List.of()).stream()
            .filter(FilePart.class::isInstance)
            .map(part -> new FilePartImage((FilePart) part))
            .collect(Collectors.toList());
    }

    /**
     * Value of a plain form field, null when absent or blank.
     */
    static String field(MultiValueMap<String, Part> parts, String name) {
        Part part = parts.getFirst(name);
        if (part instanceof FormFieldPart field && !field.value().isBlank()) {
            return field.value();
        }
        return null;
    }
}
