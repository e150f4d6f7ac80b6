package io.intellixity.arbor.query;

public enum Clause { AND, OR }
