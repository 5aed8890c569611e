/**
 * Domain layer: entities, creation inputs, repository ports and creation services.
 *
 * <ul>
 *   <li>Domain MUST NOT depend on infrastructure or api packages
 *   <li>Business failures are returned as {@link com.cityhive.service.domain.creation.CreationResult},
 *       never thrown
 *   <li>Repository ports are implemented by {@code infrastructure.persistence}
 * </ul>
 */
package com.cityhive.service.domain;
