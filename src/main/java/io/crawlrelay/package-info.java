/**
 * CrawlRelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.crawlrelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.crawlrelay.cli.CrawlRelayCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.crawlrelay.runtime.WorkerSupervisor} drives one subscription: recovery, staging, dispatch, retry.</li>
 *   <li>{@code io.crawlrelay.stage.DurableStage} is the crash-safe local queue.</li>
 * </ul>
 */
package io.crawlrelay;
