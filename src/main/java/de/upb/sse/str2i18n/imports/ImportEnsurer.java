package de.upb.sse.str2i18n.imports;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;

import java.util.logging.Logger;

public class ImportEnsurer {
    private static final Logger logger = Logger.getLogger(ImportEnsurer.class.getName());

    /**
     * Appends {@code import dependencyPath;} unless the unit already has exactly that import.
     * Repeated calls with the same path leave a single declaration.
     *
     * @return true if an import was added
     */
    public boolean ensure(CompilationUnit cu, String dependencyPath) {
        for (ImportDeclaration imp : cu.getImports()) {
            if (imp.isStatic() || imp.isAsterisk()) continue;
            if (imp.getNameAsString().equals(dependencyPath)) return false;
        }

        cu.getImports().add(new ImportDeclaration(dependencyPath, false, false));
        logger.fine(() -> "Added import " + dependencyPath);
        return true;
    }
}
