/**
 * YAML configuration, hot reload and retry policy snapshots.
 */
package fr.lapetina.llmrelay.infrastructure.config;
