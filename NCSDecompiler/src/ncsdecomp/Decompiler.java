package ncsdecomp;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import ncsdecomp.Script.Routine;
import ncsdecomp.Script.Statement;

/**
 * Entry point of the pipeline: bytes are decoded, lifted into a node tree, stack-tracked per
 * subroutine, reconstructed into a {@link Script} and rendered as source.
 *
 * <p>Decode errors abandon the program. A subroutine whose stack cannot be tracked is emitted as a
 * placeholder and reported in {@link DecompileResult#outcomes()}; the rest of the program is still
 * decompiled. Instances hold no mutable state and may be shared between threads.
 */
public final class Decompiler {
  private static final Logger LOGGER = LogManager.getLogger();

  private final DecompilerOptions options;
  private final ActionTables actionTables;

  public Decompiler(DecompilerOptions options, ActionTables actionTables) {
    this.options = options;
    this.actionTables = actionTables;
  }

  public DecompilerOptions options() {
    return options;
  }

  public ActionTable actions() {
    return actionTables.forVariant(options.variant());
  }

  public DecompileResult decompile(byte[] ncs) throws DecompilerException {
    return decompile(ncs, () -> false);
  }

  /**
   * Decompiles {@code ncs}, polling {@code cancelled} before each subroutine.
   *
   * @throws CancellationException once {@code cancelled} reports true
   */
  public DecompileResult decompile(byte[] ncs, BooleanSupplier cancelled)
      throws DecompilerException {
    return decompile(NcsReader.read(ncs), cancelled);
  }

  public DecompileResult decompile(List<Instruction> instructions, BooleanSupplier cancelled)
      throws DecompilerException {
    Program program = new NodeTreeBuilder(ImmutableList.copyOf(instructions)).build();
    SignatureAnalyzer.Analysis analysis = new SignatureAnalyzer(program, actions()).analyze();
    ActionTable actions = analysis.actions();
    ImmutableMap<Integer, String> routineNames = routineNames(program, analysis.signatures());

    List<SubroutineOutcome> outcomes = new ArrayList<>();
    ImmutableList<Statement> globals = ImmutableList.of();
    Optional<Subroutine> globalsRoutine = program.globals();
    if (globalsRoutine.isPresent()) {
      checkCancelled(cancelled);
      Subroutine subroutine = globalsRoutine.get();
      try {
        globals = reconstructGlobals(program, subroutine, analysis, actions);
        outcomes.add(SubroutineOutcome.success(subroutine.index(), subroutine.role(), "globals"));
      } catch (DecompilerException ex) {
        LOGGER.warn("Globals of {} failed: {}", subroutine, ex.describe());
        globals =
            ImmutableList.of(Script.ErrorComment.create(subroutine.startPos(), ex.describe()));
        outcomes.add(
            SubroutineOutcome.failure(subroutine.index(), subroutine.role(), "globals", ex));
      }
    }

    Stream<Subroutine> emitted =
        program.subroutines().stream()
            .filter(
                s -> s.role() == Subroutine.Role.MAIN || s.role() == Subroutine.Role.ORDINARY);
    if (options.parallelSubroutines()) {
      emitted = emitted.parallel();
    }
    List<RoutineOutcome> routines;
    try {
      routines =
          emitted
              .map(
                  s -> {
                    checkCancelled(cancelled);
                    return decompileRoutine(program, s, analysis, actions, routineNames);
                  })
              .collect(ImmutableList.toImmutableList());
    } catch (FatalRoutineError ex) {
      throw ex.error;
    }

    ImmutableList.Builder<Routine> script = ImmutableList.builder();
    for (RoutineOutcome routine : routines) {
      script.add(routine.routine);
      outcomes.add(routine.outcome);
    }
    Script tree = Script.create(globals, script.build(), routineNames);
    String source = SourceEmitter.emit(tree, actions);
    return DecompileResult.create(program, tree, source, ImmutableList.copyOf(outcomes));
  }

  private static final class RoutineOutcome {
    final Routine routine;
    final SubroutineOutcome outcome;

    RoutineOutcome(Routine routine, SubroutineOutcome outcome) {
      this.routine = routine;
      this.outcome = outcome;
    }
  }

  /** Carries an error that abandons the program out of a stream pipeline. */
  private static final class FatalRoutineError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    final DecompilerException error;

    FatalRoutineError(DecompilerException error) {
      super(error);
      this.error = error;
    }
  }

  private RoutineOutcome decompileRoutine(
      Program program,
      Subroutine subroutine,
      SignatureAnalyzer.Analysis analysis,
      ActionTable actions,
      Map<Integer, String> routineNames) {
    SubroutineSignature signature = analysis.signatures().get(subroutine.index());
    String name = routineNames.get(subroutine.index());
    try {
      StackTracker.Result result =
          new StackTracker(
                  program, subroutine, analysis.signatures(), analysis.globalFrame(), actions)
              .run();
      ControlFlowClassifier.ControlFlow flow = ControlFlowClassifier.classify(program, subroutine);
      Script.Function function =
          new Reconstructor(program, result, flow, actions, options)
              .reconstructFunction(signature);
      return new RoutineOutcome(
          function, SubroutineOutcome.success(subroutine.index(), subroutine.role(), name));
    } catch (DecompilerException ex) {
      if (!ex.kind().isSubroutineScoped()) throw new FatalRoutineError(ex);
      LOGGER.warn("{} ({}) failed: {}", name, subroutine, ex.describe());
      return new RoutineOutcome(
          Script.FailedFunction.create(signature, subroutine.role(), subroutine.startPos(), ex),
          SubroutineOutcome.failure(subroutine.index(), subroutine.role(), name, ex));
    }
  }

  private ImmutableList<Statement> reconstructGlobals(
      Program program,
      Subroutine subroutine,
      SignatureAnalyzer.Analysis analysis,
      ActionTable actions)
      throws DecompilerException {
    if (!analysis.globalsResult().isPresent()) {
      throw new DecompilerException(
          subroutine.startPos(),
          DecompilerException.ErrorKind.STACK_UNDERFLOW,
          "global declarations could not be tracked");
    }
    StackTracker.Result result = analysis.globalsResult().get();
    ControlFlowClassifier.ControlFlow flow = ControlFlowClassifier.classify(program, subroutine);
    return new Reconstructor(program, result, flow, actions, options)
        .reconstructGlobals();
  }

  /**
   * The entry routine is {@code main}, or {@code StartingConditional} when the script hands an
   * int back to the engine. Other routines are numbered {@code sub1, sub2, ...} in file order.
   */
  static ImmutableMap<Integer, String> routineNames(
      Program program, Map<Integer, SubroutineSignature> signatures) {
    ImmutableMap.Builder<Integer, String> names = ImmutableMap.builder();
    int ordinary = 0;
    for (Subroutine subroutine : program.subroutines()) {
      switch (subroutine.role()) {
        case MAIN:
          boolean conditional =
              program.entryStyle() == Program.EntryStyle.CONDITIONAL_STUB
                  || signatures.get(subroutine.index()).returnType() != ValueType.VOID;
          names.put(subroutine.index(), conditional ? "StartingConditional" : "main");
          break;
        case ORDINARY:
          names.put(subroutine.index(), "sub" + ++ordinary);
          break;
        default:
          break;
      }
    }
    return names.build();
  }

  private static void checkCancelled(BooleanSupplier cancelled) {
    if (cancelled.getAsBoolean()) {
      throw new CancellationException("decompilation cancelled");
    }
  }
}
