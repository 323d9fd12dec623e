/**
 * Engine configuration: {@link com.cee.config.EngineConfig} read from {@code CEE_*} environment variables
 * with documented defaults, plus a builder for programmatic use.
 */
package com.cee.config;
