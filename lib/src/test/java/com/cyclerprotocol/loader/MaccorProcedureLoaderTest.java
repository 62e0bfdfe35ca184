package com.cyclerprotocol.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cyclerprotocol.procedure.Comparison;
import com.cyclerprotocol.procedure.ControlMode;
import com.cyclerprotocol.procedure.EndCondition;
import com.cyclerprotocol.procedure.EndConditionKind;
import com.cyclerprotocol.procedure.Procedure;
import com.cyclerprotocol.procedure.ReportKind;
import com.cyclerprotocol.procedure.Step;
import com.cyclerprotocol.procedure.StepType;
import com.cyclerprotocol.testing.TestResources;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MaccorProcedureLoaderTest {
    private static final String FIXTURE = "formation-cycle.000";

    private final MaccorProcedureLoader loader = new MaccorProcedureLoader();

    @Test
    void loadsStepsFromFixture(@TempDir Path dir) throws Exception {
        Path file = TestResources.copyProcedure(FIXTURE, dir);

        Procedure procedure = loader.load(file, StandardCharsets.UTF_8);

        assertEquals(7, procedure.size());
        assertEquals(file.toString(), procedure.getSourceName());
        assertEquals(StepType.REST, procedure.step(1).getType());
        assertEquals(StepType.DO, procedure.step(2).getType());
        assertEquals("Do 1", procedure.step(2).getTypeLabel());
        assertEquals(StepType.ADVANCE_CYCLE, procedure.step(4).getType());
        assertEquals(StepType.LOOP, procedure.step(5).getType());
        assertEquals(StepType.DISCHARGE, procedure.step(6).getType());
        assertEquals(StepType.END, procedure.step(7).getType());
    }

    @Test
    void readsEndEntriesAndReports() throws Exception {
        Procedure procedure = loader.parse(FIXTURE, TestResources.procedureText(FIXTURE));

        Step rest = procedure.step(1);
        assertNull(rest.getMode());
        assertNull(rest.getValue());
        EndCondition restEnd = rest.getEndConditions().get(0);
        assertEquals(EndConditionKind.STEP_TIME, restEnd.getKind());
        assertEquals(Comparison.EQUAL, restEnd.getComparison());
        assertEquals("00:00:10", restEnd.getValue());
        assertEquals(2, restEnd.getGotoStep());
        assertEquals(ReportKind.STEP_TIME, rest.getReports().get(0).getKind());

        Step charge = procedure.step(3);
        assertEquals(ControlMode.CURRENT, charge.getMode());
        assertEquals("1.5", charge.getValue());
        assertEquals(Comparison.GREATER_OR_EQUAL, charge.getEndConditions().get(0).getComparison());
        assertEquals(4, charge.getEndConditions().get(0).getGotoStep());

        EndCondition loopCount = procedure.step(5).findEndCondition(EndConditionKind.LOOP_COUNT).orElseThrow();
        assertEquals("3", loopCount.getValue());
        assertEquals("Loop Cnt", loopCount.getKindLabel());

        Step discharge = procedure.step(6);
        assertEquals("1", discharge.getValue());
        assertEquals(Comparison.LESS_OR_EQUAL, discharge.getEndConditions().get(0).getComparison());
        assertEquals(7, discharge.getEndConditions().get(0).getGotoStep());
    }

    @Test
    void stripsByteOrderMark() throws Exception {
        String xml = TestResources.procedureText(FIXTURE);
        Procedure procedure = loader.parse("bom", (char) 0xFEFF + xml);

        assertEquals(7, procedure.size());
    }

    @Test
    void keepsUnknownStepTypesForTheConverter() throws Exception {
        Procedure procedure =
                loader.parse(
                        "inline",
                        "<MaccorTestProcedure><ProcSteps>"
                                + "<TestStep><StepType>Pause</StepType></TestStep>"
                                + "<TestStep><StepType>End</StepType></TestStep>"
                                + "</ProcSteps></MaccorTestProcedure>");

        assertEquals(StepType.UNSUPPORTED, procedure.step(1).getType());
        assertEquals("Pause", procedure.step(1).getTypeLabel());
    }

    @Test
    void blankGotoMeansNextStep() throws Exception {
        Procedure procedure =
                loader.parse(
                        "inline",
                        "<MaccorTestProcedure><ProcSteps>"
                                + "<TestStep><StepType>Rest</StepType><Ends><EndEntry><EndType>StepTime</EndType>"
                                + "<Oper>=</Oper><Step></Step><Value>::1</Value></EndEntry></Ends></TestStep>"
                                + "<TestStep><StepType>End</StepType></TestStep>"
                                + "</ProcSteps></MaccorTestProcedure>");

        assertEquals(2, procedure.step(1).getEndConditions().get(0).getGotoStep());
    }

    @Test
    void rejectsMissingProcSteps() {
        ProcedureParseException ex =
                assertThrows(
                        ProcedureParseException.class,
                        () -> loader.parse("empty.000", "<MaccorTestProcedure><header/></MaccorTestProcedure>"));
        assertTrue(ex.getMessage().contains("ProcSteps"));
    }

    @Test
    void rejectsWrongDocumentElement() {
        assertThrows(ProcedureParseException.class, () -> loader.parse("other.xml", "<Other/>"));
    }

    @Test
    void rejectsGotoPastLastStep() {
        String xml =
                "<MaccorTestProcedure><ProcSteps>"
                        + "<TestStep><StepType>Rest</StepType><Ends><EndEntry><EndType>StepTime</EndType>"
                        + "<Oper>=</Oper><Step>009</Step><Value>::1</Value></EndEntry></Ends></TestStep>"
                        + "<TestStep><StepType>End</StepType></TestStep>"
                        + "</ProcSteps></MaccorTestProcedure>";

        ProcedureParseException ex = assertThrows(ProcedureParseException.class, () -> loader.parse("goto", xml));
        assertTrue(ex.getMessage().contains("step 9"));
    }

    @Test
    void rejectsProcedureWithoutEnd() {
        String xml =
                "<MaccorTestProcedure><ProcSteps>"
                        + "<TestStep><StepType>Rest</StepType></TestStep>"
                        + "</ProcSteps></MaccorTestProcedure>";

        assertThrows(ProcedureParseException.class, () -> loader.parse("no-end", xml));
    }

    @Test
    void readsLatin1Source(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("latin1.000");
        String xml =
                "<MaccorTestProcedure><header><desc>25 " + (char) 0xB0 + "C</desc></header><ProcSteps>"
                        + "<TestStep><StepType>End</StepType></TestStep>"
                        + "</ProcSteps></MaccorTestProcedure>";
        Files.write(file, xml.getBytes(StandardCharsets.ISO_8859_1));

        Procedure procedure = loader.load(file, StandardCharsets.ISO_8859_1);

        assertEquals(1, procedure.size());
    }
}
