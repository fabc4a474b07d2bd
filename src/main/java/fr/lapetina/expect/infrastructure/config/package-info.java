/**
 * Configuration loading.
 *
 * <p>This package handles YAML configuration parsing. The configuration is read once, from
 * {@code expect.yaml} on the file system or the classpath, or from the location given by the
 * {@code expect.config} system property. Without a configuration file the defaults apply.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code reporter} - Reporter type, verb texts, bullets and indentation</li>
 *   <li>{@code formatter} - Type display and cut-off length for printed values</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * reporter:
 *   type: text
 *   indent: 2
 *   rootBullet: "*"
 * formatter:
 *   showTypes: true
 * }</pre>
 *
 * @see fr.lapetina.expect.infrastructure.config.ExpectationConfig
 * @see fr.lapetina.expect.infrastructure.config.ConfigLoader
 */
package fr.lapetina.expect.infrastructure.config;
