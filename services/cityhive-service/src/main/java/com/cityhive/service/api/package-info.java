/**
 * REST controllers and their request and response bodies.
 *
 * <p>Request bodies are checked for shape with Bean Validation, sanitized, and handed to the domain
 * services as creation inputs. JSON property names are snake_case
 * ({@code spring.jackson.property-naming-strategy}). Successful responses carry
 * {@code "success": true}; failures are ProblemDetail bodies carrying {@code "success": false}.
 */
package com.cityhive.service.api;
