package ghnotif.domain.sort;

public enum SortDirection {
    ASCENDING,
    DESCENDING
}
