/**
 * Relational sources read through DBUnit.
 */
package io.github.yok.flexintegrity.db;
