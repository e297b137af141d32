package io.github.jakubt4.astrolabe.dto;

/**
 * @param mu            standard gravitational parameter of the primary, m^3/s^2
 * @param currentRadius radius of the current circular orbit, m
 * @param newRadius     radius of the target circular orbit, m
 */
public record HohmannRequest(Double mu, Double currentRadius, Double newRadius) {
}
