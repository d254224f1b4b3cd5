package com.csveditor.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class SingleCellSelection extends Selection {

    private final Cell cell;

    @JsonCreator
    public SingleCellSelection(@JsonProperty("cell") Cell cell) {
        this.cell = Objects.requireNonNull(cell, "cell");
    }

    public Cell getCell() {
        return cell;
    }

    @Override
    @JsonIgnore
    public int getStartRow() {
        return cell.getRow();
    }

    @Override
    @JsonIgnore
    public int getStartColumn() {
        return cell.getColumn();
    }

    @Override
    @JsonIgnore
    public int getEndRow() {
        return cell.getRow();
    }

    @Override
    @JsonIgnore
    public int getEndColumn() {
        return cell.getColumn();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SingleCellSelection && cell.equals(((SingleCellSelection) o).cell);
    }

    @Override
    public int hashCode() {
        return cell.hashCode();
    }

    @Override
    public String toString() {
        return "SingleCell" + cell;
    }
}
