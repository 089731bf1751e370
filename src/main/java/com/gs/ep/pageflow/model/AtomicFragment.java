package com.gs.ep.pageflow.model;

/**
 * Image or drawing placed as a single unit.
 */
public class AtomicFragment extends Fragment {

    public AtomicFragment(String blockId, BlockKind kind, double x, double y, double width, double height) {
        super(blockId, kind, x, y, width, height);
    }
}
