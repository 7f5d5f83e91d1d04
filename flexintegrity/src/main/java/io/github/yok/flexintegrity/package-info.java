/**
 * Root package of FlexIntegrity.
 *
 * <p>
 * Provides a CLI/library that ingests CSV, Excel, PDF/text and relational sources into one table
 * and scores its data integrity (completeness, consistency, valid/invalid records).
 * </p>
 *
 * <p>
 * Main responsibilities are separated into the following subpackages:
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.flexintegrity.config}: configuration models</li>
 * <li>{@code io.github.yok.flexintegrity.model}: table, cell, source and metrics types</li>
 * <li>{@code io.github.yok.flexintegrity.parser}: per-format parsers</li>
 * <li>{@code io.github.yok.flexintegrity.core}: dispatch, unification and scoring workflow</li>
 * <li>{@code io.github.yok.flexintegrity.db}: relational sources (DBUnit integration)</li>
 * </ul>
 */
package io.github.yok.flexintegrity;
