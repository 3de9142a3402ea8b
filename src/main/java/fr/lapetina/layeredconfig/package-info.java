/**
 * Layered Config - configuration manager merging defaults, a file or remote backend, and the environment.
 *
 * <p>Settings are resolved by precedence, highest first: environment variables, the remote
 * backend or the local file, then defaults. An optional schema object is decoded and validated
 * on every load.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.layeredconfig.ConfigManager} - Main entry point: load, watch, typed getters</li>
 *   <li>{@link fr.lapetina.layeredconfig.ConfigChangeListener} - Callback invoked after a watched change</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (ConfigManager config = ConfigManager.builder(Path.of("config.yaml"))
 *         .envPrefix("APP")
 *         .defaults(Map.of("server.port", 8080))
 *         .watchEnabled(true)
 *         .build()) {
 *     config.load();
 *     config.watch(CancellationSignal.create(), outcome -> restartListeners());
 *
 *     int port = config.getInt("server.port");
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>YAML, JSON and properties files</li>
 *   <li>Remote backends over HTTP (plain, Consul, etcd v3)</li>
 *   <li>Hot reload through file watching or remote polling</li>
 *   <li>Schema validation with Jakarta Bean Validation</li>
 *   <li>Micrometer metrics</li>
 * </ul>
 *
 * @see fr.lapetina.layeredconfig.ConfigManager
 */
package fr.lapetina.layeredconfig;
