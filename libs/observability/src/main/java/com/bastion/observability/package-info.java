/**
 * Request correlation, log redaction and metric helpers shared by every Bastion module.
 *
 * <p>{@link com.bastion.observability.CorrelationContextHolder} is the thread-local slot the
 * gateway fills per request; {@link com.bastion.observability.SensitiveDataRedactor} keeps
 * cookies and password hashes out of logs; {@link com.bastion.observability.MetricFactory}
 * stamps every meter with the service name.
 */
package com.bastion.observability;
