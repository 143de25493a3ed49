package com.statementprocessor.domain.enums;

/**
 * Instrument classification used across trades, positions and balances.
 * UNCLASSIFIED marks instruments whose identifier could not be resolved; they are kept
 * in the snapshot's position detail and reported as reconciliation warnings.
 */
public enum AssetClass {
    EQUITY,
    OPTION,
    FOREX,
    UNCLASSIFIED;

    /**
     * Maps the broker's "Asset Category" column to an asset class.
     *
     * @return the matching asset class, or null when the category is not recognised
     */
    public static AssetClass fromCategory(String category) {
        if (category == null) {
            return null;
        }
        return switch (category.trim()) {
            case "Stocks", "ETFs", "Equity" -> EQUITY;
            case "Equity and Index Options", "Options" -> OPTION;
            case "Forex", "Cash", "Currency" -> FOREX;
            default -> null;
        };
    }
}
