package org.lokray.pyrite.symbol;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lokray.pyrite.util.NameResolutionException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QualifiedReferenceTest
{
	private ModuleSymbol root;
	private ModuleSymbol geometry;
	private ModuleSymbol shapes;
	private ClassSymbol origin;
	private ModuleSymbol app;

	@BeforeEach
	void buildTree()
	{
		root = new ModuleSymbol("");
		geometry = new ModuleSymbol("geometry", root);
		shapes = new ModuleSymbol("shapes", geometry);
		ClassSymbol point = new ClassSymbol(shapes, "Point");
		origin = new ClassSymbol(point, "Origin");
		app = new ModuleSymbol("app", root);
	}

	@Test
	void splitsModulePathFromRelativePath()
	{
		QualifiedReference ref = QualifiedReference.resolve(app, "geometry::shapes::Point::Origin");

		assertEquals("geometry.shapes", ref.getScope());
		assertSame(shapes, ref.getDeclaringModule());
		assertEquals(List.of("Point", "Origin"), ref.getNameParts());
		assertEquals("Point", ref.getImportedSymbol());
		assertEquals("Point.Origin", ref.getDisplayName());
		assertSame(origin, ref.getTarget());
		assertFalse(ref.isModuleReference());
	}

	@Test
	void moduleOnlyReferenceImportsTheModule()
	{
		QualifiedReference ref = QualifiedReference.resolve(app, "::geometry::shapes");

		assertTrue(ref.isModuleReference());
		assertNull(ref.getImportedSymbol());
		assertEquals("geometry.shapes", ref.getDisplayName());

		ref.recordImport(app);
		assertTrue(app.getImports().get("geometry.shapes").isEmpty());
	}

	@Test
	void declaringModuleRecordsNoImport()
	{
		QualifiedReference ref = QualifiedReference.resolve(shapes, "geometry::shapes::Point");
		ref.recordImport(shapes);

		assertTrue(shapes.getImports().isEmpty());
	}

	@Test
	void declarationsInAnUnnamedRootNeedNoImport()
	{
		new ClassSymbol(root, "Global");
		QualifiedReference ref = QualifiedReference.resolve(app, "::Global");
		ref.recordImport(app);

		assertSame(root, ref.getDeclaringModule());
		assertEquals("Global", ref.getDisplayName());
		assertTrue(app.getImports().isEmpty());
	}

	@Test
	void missingSegmentFails()
	{
		assertThrows(NameResolutionException.class, () -> QualifiedReference.resolve(app, "geometry::lines::Segment"));
	}
}
