package com.musicgroups.edit.validation;

import com.musicgroups.edit.EditableRow;
import com.musicgroups.edit.MusicGroupInput;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Validates only the fields a form action touches. The edit form holds several
 * independently submitted actions over one shared working copy, so a violation on a
 * field outside the action must not block it.
 */
@Component
public class ValidationGate {

    private final Validator validator;

    public ValidationGate(Validator validator) {
        this.validator = validator;
    }

    public ValidationResult validatePartial(MusicGroupInput input, Collection<FieldPath> paths) {
        List<FieldError> errors = new ArrayList<>();
        for (FieldPath path : paths) {
            Object bean = resolve(input, path);
            validator.validateProperty(bean, path.field().property()).stream()
                .map(ConstraintViolation::getMessage)
                .sorted(Comparator.naturalOrder())
                .forEach(message -> errors.add(new FieldError(path.toString(), message)));
        }
        return errors.isEmpty() ? ValidationResult.valid() : new ValidationResult(errors);
    }

    private static Object resolve(MusicGroupInput input, FieldPath path) {
        Object bean = switch (path.field().scope()) {
            case GROUP -> input;
            case NEW_ALBUM -> input.getNewAlbum();
            case NEW_ARTIST -> input.getNewArtist();
            case ALBUM_ROW -> row(input.getAlbums(), path).getPending();
            case ARTIST_ROW -> row(input.getArtists(), path).getPending();
        };
        if (bean == null) {
            throw new IllegalArgumentException("Nothing to validate at " + path);
        }
        return bean;
    }

    private static EditableRow<?> row(List<? extends EditableRow<?>> rows, FieldPath path) {
        if (path.index() >= rows.size()) {
            throw new IllegalArgumentException("No row at " + path + ", collection has " + rows.size());
        }
        return rows.get(path.index());
    }
}
