package cfix.analysis;

import cfix.hir.PrintTools;
import cfix.hir.Tools;
import cfix.hir.TranslationUnit;

public abstract class AnalysisPass
{
  protected TranslationUnit unit;

  protected AnalysisPass(TranslationUnit unit)
  {
    this.unit = unit;
  }

  public abstract String getPassName();

  public static void run(AnalysisPass pass)
  {
    double timer = Tools.getTime();
    PrintTools.println(pass.getPassName() + " begin", 1);
    pass.start();
    PrintTools.println(pass.getPassName() + " end in " +
      String.format("%.2f seconds", Tools.getTime(timer)), 1);
    if (!pass.unit.checkConsistency())
      throw new InternalError("Inconsistent tokens after " + pass.getPassName());
  }

  public abstract void start();
}
