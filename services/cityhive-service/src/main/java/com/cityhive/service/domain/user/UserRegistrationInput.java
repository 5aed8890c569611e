package com.cityhive.service.domain.user;

/**
 * Registration request after sanitizing: name trimmed, email trimmed and lower-cased.
 */
public record UserRegistrationInput(String name, String email) {
}
