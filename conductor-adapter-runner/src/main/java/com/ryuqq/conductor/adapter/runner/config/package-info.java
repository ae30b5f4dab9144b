/**
 * conductor.yaml loading (SnakeYAML), fail-closed startup validation and conversion to immutable config records.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.adapter.runner.config;
