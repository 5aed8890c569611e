/**
 * Health probing, correlation context and metrics shared by CityHive services.
 */
package com.cityhive.observability;
