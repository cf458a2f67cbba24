package com.librarylending.lending.projections;

import java.util.Objects;

public final class CatalogStatistics {
    public final int totalBooks;
    public final int available;
    public final int onHold;
    public final int checkedOut;

    public CatalogStatistics(int totalBooks, int available, int onHold, int checkedOut) {
        this.totalBooks = totalBooks;
        this.available = available;
        this.onHold = onHold;
        this.checkedOut = checkedOut;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CatalogStatistics)) return false;
        var that = (CatalogStatistics) o;
        return totalBooks == that.totalBooks && available == that.available && onHold == that.onHold && checkedOut == that.checkedOut;
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalBooks, available, onHold, checkedOut);
    }

    @Override
    public String toString() {
        return "CatalogStatistics{" +
                "totalBooks=" + totalBooks +
                ", available=" + available +
                ", onHold=" + onHold +
                ", checkedOut=" + checkedOut +
                '}';
    }
}
