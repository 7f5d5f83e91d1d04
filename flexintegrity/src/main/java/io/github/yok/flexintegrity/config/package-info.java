/**
 * Configuration model package for FlexIntegrity.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml} (or equivalent
 * sources), such as ingestion settings and relational connection settings.
 * </p>
 */
package io.github.yok.flexintegrity.config;
