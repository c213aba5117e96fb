package com.vtb.parity.dynamic;

import com.vtb.parity.models.StepResult;
import com.vtb.parity.models.TargetSide;
import lombok.Value;

@Value
public class StepPair {
    StepResult targetA;
    StepResult targetB;

    public StepResult side(TargetSide side) {
        return side == TargetSide.B ? targetB : targetA;
    }

    public boolean bothTerminal() {
        return targetA.isTerminal() && targetB.isTerminal();
    }
}
