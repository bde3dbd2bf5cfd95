/**
 * Test doubles: a mutable clock, scripted pipeline client, recording notifier and request builders.
 */
package com.ryuqq.provisioning.testkit.fake;
