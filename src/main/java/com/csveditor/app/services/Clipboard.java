package com.csveditor.app.services;

import java.util.ArrayList;
import java.util.List;

/**
 * A detached rectangular block of copied values, row-major.
 * Replaced wholesale on every copy; read by every paste. Lives independently
 * of any grid, so it survives loading a different file into the editor.
 */
public class Clipboard {

    private List<List<String>> contents = List.of();

    public void put(List<List<String>> block) {
        List<List<String>> frozen = new ArrayList<>(block.size());
        for (List<String> row : block) {
            frozen.add(List.copyOf(row));
        }
        contents = List.copyOf(frozen);
    }

    public List<List<String>> getContents() {
        return contents;
    }

    public boolean isEmpty() {
        return contents.isEmpty();
    }

    public int getRowCount() {
        return contents.size();
    }

    public int getColumnCount() {
        return contents.isEmpty() ? 0 : contents.get(0).size();
    }

    public void clear() {
        contents = List.of();
    }
}
