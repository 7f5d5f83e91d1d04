/**
 * Source parser package for FlexIntegrity.
 *
 * <p>
 * Defines a common {@code SourceParser} abstraction and concrete parsers for delimited text,
 * spreadsheets and documents. Parsers read raw bytes into a {@code Table}.
 * </p>
 *
 * <p>
 * Kind detection and parser instantiation are handled by {@code SourceKind} and
 * {@code SourceParserFactory}.
 * </p>
 */
package io.github.yok.flexintegrity.parser;
