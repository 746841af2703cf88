/**
 * MailDigest source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.maildigest.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.maildigest.cli.MailDigestCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.maildigest.runtime.CycleOrchestrator} runs one poll, classify and persist pass.</li>
 *   <li>{@code io.maildigest.storage.WorklistStore} owns the digest entry lifecycle.</li>
 * </ul>
 */
package io.maildigest;
