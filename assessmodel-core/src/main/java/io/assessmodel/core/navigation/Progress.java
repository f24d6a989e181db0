package io.assessmodel.core.navigation;

/// Position of a node within its branch.
///
/// @param current zero-based index of the node
/// @param total number of nodes in the branch
/// @param isEstimated true when survey rules may shorten or lengthen the realized path
public record Progress(int current, int total, boolean isEstimated) {}
