package com.classlayout.core.engine;

import com.classlayout.core.layout.ClassMember;
import com.classlayout.core.layout.ClassifierKind;
import com.classlayout.core.model.Classifier;
import com.classlayout.core.model.ClassifierType;
import com.classlayout.core.model.Member;
import com.classlayout.core.model.Visibility;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the classifier to box mapping in {@link ClassBoxFactory}.
 */
class ClassBoxFactoryTest {

    @Test
    void kindOf_shorthandTypes_mapToClass() {
        assertThat(ClassBoxFactory.kindOf(ClassifierType.CIRCLE)).isEqualTo(ClassifierKind.CLASS);
        assertThat(ClassBoxFactory.kindOf(ClassifierType.DIAMOND)).isEqualTo(ClassifierKind.CLASS);
        assertThat(ClassBoxFactory.kindOf(ClassifierType.ABSTRACT_CLASS)).isEqualTo(ClassifierKind.ABSTRACT_CLASS);
        assertThat(ClassBoxFactory.kindOf(ClassifierType.ENTITY)).isEqualTo(ClassifierKind.ENTITY);
    }

    @Test
    void stereotypeOf_derivedFromType() {
        assertThat(ClassBoxFactory.stereotypeOf(Classifier.interfaceOf("I"))).isEqualTo("interface");
        assertThat(ClassBoxFactory.stereotypeOf(Classifier.abstractOf("A"))).isEqualTo("abstract");
        assertThat(ClassBoxFactory.stereotypeOf(Classifier.enumOf("E"))).isEqualTo("enum");
        assertThat(ClassBoxFactory.stereotypeOf(Classifier.of("C"))).isNull();
    }

    @Test
    void stereotypeOf_explicitWins() {
        Classifier classifier = Classifier.interfaceOf("Repo").withStereotype("repository");

        assertThat(ClassBoxFactory.stereotypeOf(classifier)).isEqualTo("repository");
    }

    @Test
    void fieldLine_formatsNameAndType() {
        ClassMember line = ClassBoxFactory.fieldLine(Member.field("count", "int").asStatic().asAbstract());

        assertThat(line.text()).isEqualTo("count: int");
        assertThat(line.visibility()).isEqualTo(Visibility.PRIVATE);
        assertThat(line.staticMember()).isTrue();
        assertThat(line.abstractMember()).isFalse();
        assertThat(line.displayText()).isEqualTo("-count: int");
    }

    @Test
    void fieldLine_withoutType_isNameOnly() {
        assertThat(ClassBoxFactory.fieldLine(Member.field("RED", null)).text()).isEqualTo("RED");
    }

    @Test
    void methodLine_dropsReturnTypeAndKeepsFlags() {
        Member method = new Member("area", "double", Visibility.PROTECTED, false, true, List.of());

        ClassMember line = ClassBoxFactory.methodLine(method);

        assertThat(line.text()).isEqualTo("area()");
        assertThat(line.abstractMember()).isTrue();
        assertThat(line.displayText()).isEqualTo("#area()");
    }
}
