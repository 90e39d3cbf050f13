/**
 * TierMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.tiermesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.tiermesh.cli.TierMeshCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.tiermesh.runtime.TierMeshRuntime} wires tiers, migration, probing and routing.</li>
 *   <li>{@code io.tiermesh.migration.MigrationEngine} moves records between tiers.</li>
 *   <li>{@code io.tiermesh.storage.MetadataStore} is the authoritative catalogue.</li>
 * </ul>
 */
package io.tiermesh;
