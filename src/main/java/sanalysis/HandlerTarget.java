package sanalysis;

/** Handler entry block together with the exception kind it catches. */
final class HandlerTarget {
    final int block;
    final String exceptionKind;

    HandlerTarget(int block, String exceptionKind) {
        this.block = block;
        this.exceptionKind = exceptionKind;
    }
}
