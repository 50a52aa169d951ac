/**
 * Capability contracts: one interface per API group plus its request and result records.
 *
 * <p>Every contract is transport independent. An in-process provider implements the interface
 * directly; the classes in {@code com.gentoro.aistack.client} implement the same interfaces on top
 * of a {@link com.gentoro.aistack.client.CapabilityTransport}, either HTTP (remote providers) or
 * the local router (provider dependencies). Records use snake_case JSON names, which is also the
 * wire format of the HTTP capability endpoint.
 */
package com.gentoro.aistack.apis;
