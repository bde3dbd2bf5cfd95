/**
 * SPI contract tests.
 *
 * <p>Adapters extend these abstract classes and supply the implementation under test.</p>
 */
package com.ryuqq.provisioning.testkit.contract;
