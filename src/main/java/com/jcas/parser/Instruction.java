package com.jcas.parser;

import org.eclipse.collections.api.list.MutableList;

/**
 * One step of a reduced postfix program.
 */
public sealed interface Instruction {
    int position();

    record PushNumber(String literal, int position) implements Instruction {}

    record PushIdentifier(String name, int position) implements Instruction {}

    record ApplyOperator(Operator operator, int position) implements Instruction {}

    /**
     * A call whose argument programs are already reduced, one per argument.
     */
    record CallFunction(String name, MutableList<MutableList<Instruction>> arguments, int position)
            implements Instruction {}

    record BuildList(MutableList<MutableList<Instruction>> elements, int position) implements Instruction {}
}
