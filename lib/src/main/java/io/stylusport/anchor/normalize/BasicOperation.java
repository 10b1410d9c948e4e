package io.stylusport.anchor.normalize;

import java.util.Objects;

/** The closed set of operations an instruction body can be summarised as. */
public sealed interface BasicOperation
        permits BasicOperation.Log, BasicOperation.Initialize, BasicOperation.Transfer, BasicOperation.Close {

    record Log(String text) implements BasicOperation {
        public Log {
            Objects.requireNonNull(text, "text");
        }
    }

    record Initialize(String target, String payer) implements BasicOperation {
        public Initialize {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(payer, "payer");
        }
    }

    record Transfer(String from, String to) implements BasicOperation {
        public Transfer {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
        }
    }

    record Close(String target, String refundTo) implements BasicOperation {
        public Close {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(refundTo, "refundTo");
        }
    }
}
