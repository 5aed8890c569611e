package com.cityhive.observability;

/**
 * One round trip against a dependency.
 * <p>
 * Implementations must not change the monitored system. Returning normally means the dependency
 * answered; any exception means it did not. Example:
 * <pre>{@code
 * DependencyCheck database = () -> {
 *     try (Connection connection = dataSource.getConnection();
 *          Statement statement = connection.createStatement()) {
 *         statement.execute("SELECT 1");
 *     }
 * };
 * }</pre>
 */
@FunctionalInterface
public interface DependencyCheck {

    /**
     * Performs the round trip.
     *
     * @throws Exception if the dependency could not be reached or answered with an error
     */
    void execute() throws Exception;
}
