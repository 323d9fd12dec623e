/**
 * Pipeline and command-line entry point.
 * <ul>
 *   <li>{@link com.cee.engine.GraphCheckPipeline} runs reconcile, repair and validate with telemetry</li>
 *   <li>{@link com.cee.engine.GraphRepairer} is the repair step between reconciliation and validation</li>
 *   <li>{@link com.cee.engine.PipelineReport} is the serialisable outcome of one run</li>
 *   <li>{@link com.cee.engine.GraphCheckApplication} validates graph JSON files from the command line</li>
 * </ul>
 */
package com.cee.engine;
