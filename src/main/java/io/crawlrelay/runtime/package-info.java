/**
 * Worker orchestration package.
 *
 * <p>{@link io.crawlrelay.runtime.CrawlRelayRuntime} runs one
 * {@link io.crawlrelay.runtime.WorkerSupervisor} per subscription. A supervisor
 * owns its staging directory and processes one job at a time.
 */
package io.crawlrelay.runtime;
