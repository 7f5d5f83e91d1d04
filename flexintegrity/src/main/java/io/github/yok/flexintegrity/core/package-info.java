/**
 * Core ingestion and scoring workflow of FlexIntegrity.
 *
 * <p>
 * {@code SourceDispatcher} parses sources, {@code TableUnifier} merges the resulting tables and
 * {@code MetricsEngine} scores the merged table. {@code IntegrityPipeline} wires the three stages.
 * </p>
 */
package io.github.yok.flexintegrity.core;
