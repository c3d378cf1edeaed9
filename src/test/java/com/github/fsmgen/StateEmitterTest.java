package com.github.fsmgen;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import java.util.List;

import org.junit.Test;

import com.github.fsmgen.GeneratorConfiguration.GeneratorConfigurationBuilder;

/**
 * Tests for rendering state classes.
 */
public class StateEmitterTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static List<StatePlan> plans() throws FsmGenException {
    final StateGraph graph = SampleGraphs.timerAndUnconditional();
    final Partition partition =
        new PartitionResolver(OverlapPolicy.REJECT).resolve(graph).get(0);
    return new StatePlanner(EventCatalog.build(graph)).plan(partition);
  }

  @Test
  public void testTimerStateWithReactions() throws FsmGenException {
    final String expected = "class FSM1_A : public FSM1 {\n"
        + "    void entry() {\n"
        + "        start_timer(TIMER_1, 500);\n"
        + "        state_A();\n"
        + "    }\n"
        + "\n"
        + "    void react(TIMER_1_EVENT const &) override {\n"
        + "        stop_timer(TIMER_1);\n"
        + "        transit<FSM1_B>();\n"
        + "    }\n"
        + "\n"
        + "    void react(GO_EVENT const &) override {\n"
        + "        stop_timer(TIMER_1);\n"
        + "        transit<FSM1_C>();\n"
        + "    }\n"
        + "};\n";
    assertEquals(expected,
        new StateEmitter(GeneratorConfiguration.defaults()).emit(plans().get(0)));
  }

  @Test
  public void testStubModeOmitsTimerCalls() throws FsmGenException {
    final GeneratorConfiguration stubs =
        GeneratorConfigurationBuilder.newBuilder().stubs(true).build();
    final String code = new StateEmitter(stubs).emit(plans().get(0));

    assertFalse(code.contains("start_timer"));
    assertFalse(code.contains("stop_timer"));
    assertEquals("class FSM1_A : public FSM1 {\n"
        + "    void entry() {\n"
        + "        state_A();\n"
        + "    }\n"
        + "\n"
        + "    void react(TIMER_1_EVENT const &) override {\n"
        + "        transit<FSM1_B>();\n"
        + "    }\n"
        + "\n"
        + "    void react(GO_EVENT const &) override {\n"
        + "        transit<FSM1_C>();\n"
        + "    }\n"
        + "};\n", code);
  }

  @Test
  public void testUnconditionalTransitionEndsEntryAction() throws FsmGenException {
    final String expected = "class FSM1_B : public FSM1 {\n"
        + "    void entry() {\n"
        + "        state_B();\n"
        + "        transit<FSM1_C>();\n"
        + "    }\n"
        + "};\n";
    assertEquals(expected,
        new StateEmitter(GeneratorConfiguration.defaults()).emit(plans().get(1)));
  }

  @Test
  public void testTerminalState() throws FsmGenException {
    final String expected = "class FSM1_C : public FSM1 {\n"
        + "    void entry() {\n"
        + "        state_C();\n"
        + "    }\n"
        + "};\n";
    assertEquals(expected,
        new StateEmitter(GeneratorConfiguration.defaults()).emit(plans().get(2)));
  }
}
