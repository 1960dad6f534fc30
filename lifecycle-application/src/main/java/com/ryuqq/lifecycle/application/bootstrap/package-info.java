/**
 * Application bootstrap contracts: an {@link com.ryuqq.lifecycle.application.bootstrap.Initializer}
 * turns an {@link com.ryuqq.lifecycle.application.bootstrap.InitContext} into an
 * {@link com.ryuqq.lifecycle.application.bootstrap.AppContext}.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.application.bootstrap;
