package com.github.fsmgen;

import java.util.ArrayList;
import java.util.List;

/**
 * Emits the bounded event queue (Inc/fsm_fifo.hpp, Src/fsm_fifo.cpp) and the dispatch driver
 * (Inc/fsm_driver.hpp, Src/fsm_driver.cpp).
 * 
 * The queue is a single producer, single consumer ring of serialized event tags. Enqueue never
 * blocks and drops the event when the ring is full; dequeue reports whether an event was
 * available. The driver starts every machine, then loops forever draining the queue and
 * broadcasting each event, through a pre-allocated singleton, to all machines.
 */
public final class DriverAssembler {
  static final String fifoHeaderName = "fsm_fifo.hpp";
  static final String fifoSourceName = "fsm_fifo.cpp";
  static final String driverHeaderName = "fsm_driver.hpp";
  static final String driverSourceName = "fsm_driver.cpp";

  private static final String fifoGuard = "FSM_FIFO_HPP_";
  private static final String driverGuard = "FSM_DRIVER_HPP_";
  private static final String machineList = "my_fsm";

  private final GeneratorConfiguration config;

  public DriverAssembler(final GeneratorConfiguration config) {
    this.config = config;
  }

  public String emitFifoHeader(final EventCatalog catalog) {
    final StringBuilder code = new StringBuilder();
    code.append(CppSource.headerComment()).append('\n');
    code.append(CppSource.startGuard(fifoGuard)).append('\n');
    code.append(CppSource.include(EventsHeaderEmitter.fileName)).append('\n');
    code.append("#define FIFO_SIZE ").append(config.getFifoSize()).append("\n\n");
    code.append(tagEnum(catalog.events())).append('\n');
    code.append("typedef struct {\n");
    code.append("    int head = 0;\n");
    code.append("    int tail = 0;\n");
    code.append("    FSM_Event buffer[FIFO_SIZE];\n");
    code.append("} Event_FIFO;\n\n");
    code.append("void write_event(FSM_Event event);\n");
    code.append("int read_event(FSM_Event *event);\n\n");
    code.append(CppSource.endGuard(fifoGuard));
    return code.toString();
  }

  static String tagEnum(final List<CanonicalEvent> events) {
    final List<String> tags = new ArrayList<>(events.size());
    for (final CanonicalEvent event : events) {
      tags.add("    " + event.getTag());
    }
    return "typedef enum {\n" + String.join(",\n", tags) + (tags.isEmpty() ? "" : "\n")
        + "} FSM_Event;\n";
  }

  public String emitFifoSource() {
    final StringBuilder code = new StringBuilder();
    code.append(CppSource.headerComment()).append('\n');
    code.append(CppSource.include(fifoHeaderName));
    code.append(CppSource.include(EventsHeaderEmitter.fileName));
    code.append(CppSource.include(config.getPlatformHeader())).append('\n');
    code.append("Event_FIFO fifo;\n\n");
    code.append("/* Appends one event to the fifo. The event is dropped when the fifo is full.\n");
    code.append(" * Safe to call from interrupt context.\n");
    code.append(" */\n");
    code.append("void write_event(FSM_Event event) {\n");
    code.append("    __disable_irq();\n");
    code.append("    int next = (fifo.tail == (FIFO_SIZE - 1)) ? 0 : fifo.tail + 1;\n\n");
    code.append("    if (next != fifo.head) {\n");
    code.append("        fifo.buffer[fifo.tail] = event;\n");
    code.append("        fifo.tail = next;\n");
    code.append("    }\n");
    code.append("    __enable_irq();\n");
    code.append("}\n\n");
    code.append("/* Removes the oldest event from the fifo into *event.\n");
    code.append(" *\n");
    code.append(" * Returns:\n");
    code.append(" *   0 -> fifo empty, *event untouched\n");
    code.append(" *   1 -> *event updated\n");
    code.append(" */\n");
    code.append("int read_event(FSM_Event *event) {\n");
    code.append("    if (fifo.head == fifo.tail) {\n");
    code.append("        return 0;\n");
    code.append("    }\n");
    code.append("    *event = fifo.buffer[fifo.head];\n");
    code.append("    fifo.head = (fifo.head == (FIFO_SIZE - 1)) ? 0 : fifo.head + 1;\n");
    code.append("    return 1;\n");
    code.append("}\n");
    return code.toString();
  }

  public String emitDriverHeader() {
    return CppSource.headerComment() + '\n' + CppSource.startGuard(driverGuard) + '\n'
        + "void start_fsm_driver();\n\n" + CppSource.endGuard(driverGuard);
  }

  public String emitDriverSource(final List<Partition> partitions, final EventCatalog catalog) {
    final StringBuilder code = new StringBuilder();
    code.append(CppSource.headerComment()).append('\n');
    code.append(CppSource.include(driverHeaderName));
    code.append(CppSource.include(EventsHeaderEmitter.fileName));
    code.append(CppSource.include(fifoHeaderName));
    code.append(CppSource.include(CppSource.runtimeHeaderName));
    final List<String> machines = new ArrayList<>(partitions.size());
    for (final Partition partition : partitions) {
      code.append(CppSource.include(MachineAssembler.headerName(partition)));
      machines.add(partition.getName());
    }
    code.append('\n');
    code.append("using ").append(machineList).append(" = tinyfsm::FsmList<")
        .append(String.join(", ", machines)).append(">;\n\n");

    for (final CanonicalEvent event : catalog.events()) {
      code.append(event.getId()).append(' ').append(event.getSingleton()).append(" = ")
          .append(event.getId()).append("();\n");
    }
    code.append('\n');

    code.append("void start_fsm_driver() {\n");
    code.append("    FSM_Event event;\n\n");
    code.append("    ").append(machineList).append("::start();\n\n");
    code.append("    while (1) {\n");
    code.append("        if (read_event(&event)) {\n");
    code.append("            switch (event) {\n");
    for (final CanonicalEvent event : catalog.events()) {
      code.append("            case ").append(event.getTag()).append(": ").append(machineList)
          .append("::dispatch(").append(event.getSingleton()).append(");break;\n");
    }
    code.append("            }\n");
    code.append("        }\n");
    code.append("    }\n");
    code.append("}\n");
    return code.toString();
  }
}
