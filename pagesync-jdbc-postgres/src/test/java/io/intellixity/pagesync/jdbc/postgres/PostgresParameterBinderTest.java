package io.intellixity.pagesync.jdbc.postgres;

import io.intellixity.pagesync.compile.Binds;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.postgresql.util.PGobject;

import java.sql.PreparedStatement;
import java.sql.Types;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

final class PostgresParameterBinderTest {
  private final PostgresParameterBinder binder = new PostgresParameterBinder();

  @Test
  void mapGoesOutAsJsonbDocument() throws Exception {
    PreparedStatement ps = mock(PreparedStatement.class);
    binder.bind(ps, 2, Binds.of(Map.of("a", 1)));

    ArgumentCaptor<Object> sent = ArgumentCaptor.forClass(Object.class);
    verify(ps).setObject(eq(2), sent.capture());
    PGobject obj = assertInstanceOf(PGobject.class, sent.getValue());
    assertEquals("jsonb", obj.getType());
    assertEquals("{\"a\":1}", obj.getValue());
  }

  @Test
  void emptyValueLeavesTypeToTheColumn() throws Exception {
    PreparedStatement ps = mock(PreparedStatement.class);
    binder.bind(ps, 1, Binds.of(null));
    verify(ps).setNull(1, Types.OTHER);
  }
}
