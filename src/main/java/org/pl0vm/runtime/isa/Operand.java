package org.pl0vm.runtime.isa;

/**
 * Base type for instruction operands. Each operand renders itself in the
 * instruction text form through {@link Object#toString()}.
 */
public sealed interface Operand
        permits RegisterOperand, ImmediateOperand, AddressOperand, IndirectOperand, LabelOperand, ProgramOperand {}
