package io.stylusport.anchor.normalize;

import java.util.List;

/** What is known about an instruction's behaviour: nothing, or a list of recognised operations. */
public sealed interface InstructionBody permits InstructionBody.Unknown, InstructionBody.Basic {

    Unknown UNKNOWN = new Unknown();

    record Unknown() implements InstructionBody {}

    record Basic(List<BasicOperation> operations) implements InstructionBody {
        public Basic {
            operations = List.copyOf(operations);
        }
    }
}
