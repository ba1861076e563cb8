/**
 * Test fixtures shared by contract and runner tests.
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
package com.ryuqq.reviewflow.testkit.fixture;
