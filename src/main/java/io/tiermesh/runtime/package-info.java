/**
 * Runtime orchestration package.
 *
 * <p>{@link io.tiermesh.runtime.TierMeshRuntime} owns cross-cutting behavior: record
 * ingest and restore, the scheduled quota check feeding the migration mailbox, probe
 * loops and the status and metrics views used by the CLI.
 */
package io.tiermesh.runtime;
