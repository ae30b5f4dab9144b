/**
 * In-memory store adapters: key/value collaborator store and terminal work unit store.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.adapter.inmemory.store;
