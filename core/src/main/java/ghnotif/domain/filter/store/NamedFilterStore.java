package ghnotif.domain.filter.store;

/**
 * Resolves the name in an {@code @name} filter reference to its expression.
 */
@FunctionalInterface
public interface NamedFilterStore {
    /**
     * @throws ghnotif.domain.exceptions.FilterReferenceFailure if there is no filter with this name
     */
    String lookup(String name);
}
