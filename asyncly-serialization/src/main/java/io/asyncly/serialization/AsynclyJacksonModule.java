package io.asyncly.serialization;

import com.fasterxml.jackson.databind.jsontype.PolymorphicTypeValidator;
import com.fasterxml.jackson.databind.module.SimpleModule;
import io.asyncly.core.journal.Journal;
import io.asyncly.core.journal.JournalEntry;
import io.asyncly.serialization.mixin.JournalMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all asyncly serialization configuration in one place.
///
/// - `JournalEntry`: `JournalEntrySerializer` / `JournalEntryDeserializer`,
///   discriminator: `"type"`, recorded values written with their Java type ids
/// - `Journal`: record binding through its `entries` component, shaped by `JournalMixin`
///
/// @see JournalSerializer for the convenience factory API
public class AsynclyJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 2374401829716505543L;

    /// Creates the module with the default recorded value types of
    /// {@link JournalSerializer#recordedValueTypes()}.
    public AsynclyJacksonModule() {
        this(JournalSerializer.recordedValueTypes().build());
    }

    /// Creates the module restoring only recorded values whose types `allowedTypes` accepts.
    ///
    /// @param allowedTypes validator consulted for every type id read back, not null
    public AsynclyJacksonModule(PolymorphicTypeValidator allowedTypes) {
        super("AsynclyJacksonModule");

        RecordedValueCodec values = new RecordedValueCodec(allowedTypes);
        addSerializer(JournalEntry.class, new JournalEntrySerializer(values));
        addDeserializer(JournalEntry.class, new JournalEntryDeserializer(values));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);
        context.setMixInAnnotations(Journal.class, JournalMixin.class);
    }
}
