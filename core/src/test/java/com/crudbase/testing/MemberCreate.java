package com.crudbase.testing;

import com.crudbase.model.EntityInput;
import com.crudbase.model.FieldValues;
import java.util.Map;
import javax.annotation.Nullable;

/** Create input for {@link Member}. */
public record MemberCreate(String name, String email, @Nullable String nickname)
    implements EntityInput {

  public MemberCreate(String name, String email) {
    this(name, email, null);
  }

  @Override
  public Map<String, Object> fieldValues() {
    return FieldValues.builder()
        .put("name", name)
        .put("email", email)
        .putIfNotNull("nickname", nickname)
        .build();
  }
}
