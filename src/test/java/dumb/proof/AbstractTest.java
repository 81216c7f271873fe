package dumb.proof;

import dumb.proof.Formula.Var;
import dumb.proof.FormulaParser.ParseException;
import dumb.proof.LogicException.Fault;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.fail;

abstract class AbstractTest {

    static final Var A = Var.of("A"), B = Var.of("B"), C = Var.of("C"), P = Var.of("P"), Q = Var.of("Q"), X = Var.of("X"), Y = Var.of("Y");

    /** Formula in Polish notation. */
    static Formula f(String polish) {
        try {
            return FormulaParser.parse(polish);
        } catch (ParseException e) {
            fail("Failed to parse formula '" + polish + "': " + e.getMessage());
            return null;
        }
    }

    static List<Formula> fs(String... polish) {
        return Arrays.stream(polish).map(AbstractTest::f).toList();
    }

    static Verdict.Verified assertVerified(Verdict v) {
        if (!(v instanceof Verdict.Verified verified))
            return fail("Expected VERIFIED but got " + v);
        return verified;
    }

    static Verdict.Failed assertFailed(Verdict v, Fault fault, int step) {
        var failed = assertInstanceOf(Verdict.Failed.class, v, () -> "Expected FAILED but got " + v);
        assertEquals(fault, failed.fault(), failed::message);
        assertEquals(step, failed.step(), failed::message);
        return failed;
    }

    static LogicException assertFault(Fault fault, LogicException e) {
        assertEquals(fault, e.fault, e::getMessage);
        return e;
    }
}
