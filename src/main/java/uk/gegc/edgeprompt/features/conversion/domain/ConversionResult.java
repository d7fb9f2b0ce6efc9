package uk.gegc.edgeprompt.features.conversion.domain;

/**
 * Result of document conversion containing the extracted text.
 */
public record ConversionResult(String text) {
}
