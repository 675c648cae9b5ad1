package ai.rtlgraph.scan;

import ai.rtlgraph.model.RefKind;

/**
 * Typed result of one recognized dump line. A line may yield several events.
 */
public sealed interface DumpEvent {

    record EnterFunction(String name, String sourceFile) implements DumpEvent {
    }

    record SetDisplayLabel(String name, String label) implements DumpEvent {
    }

    record RegisterNameAlias(String demangled, String mangled) implements DumpEvent {
    }

    record RecordReference(String caller, String callee, RefKind kind) implements DumpEvent {
    }
}
