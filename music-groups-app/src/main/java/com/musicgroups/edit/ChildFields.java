package com.musicgroups.edit;

/**
 * Scalar fields of one child record, as shown and edited on the form.
 */
public interface ChildFields<F extends ChildFields<F>> {

    F copy();
}
