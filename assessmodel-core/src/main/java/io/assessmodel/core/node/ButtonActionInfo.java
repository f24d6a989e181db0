package io.assessmodel.core.node;

/// Label override for a navigation button.
///
/// @param buttonTitle text to display on the button, may be null to keep the default label
public record ButtonActionInfo(String buttonTitle) {}
