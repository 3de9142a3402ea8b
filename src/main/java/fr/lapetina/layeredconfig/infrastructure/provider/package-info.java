/**
 * Configuration sources.
 *
 * <p>A provider reads its source and repopulates the settings store in one exclusive step.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.layeredconfig.infrastructure.provider.LocalConfigProvider} - File source</li>
 *   <li>{@link fr.lapetina.layeredconfig.infrastructure.provider.RemoteConfigProvider} - Remote key/value source with timeout</li>
 *   <li>{@link fr.lapetina.layeredconfig.infrastructure.provider.AbstractConfigProvider} - Shared reset, merge and bind sequence</li>
 * </ul>
 */
package fr.lapetina.layeredconfig.infrastructure.provider;
